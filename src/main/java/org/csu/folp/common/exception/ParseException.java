package org.csu.folp.common.exception;

import lombok.Getter;
import org.csu.folp.compiler.lexer.Token;

/**
 * @author hidyouth
 * @description: 语法分析阶段的异常，记录出错的Token及其在Token流中的下标。
 * 到达输入末尾时 token 为 null，tokenIndex 等于Token总数。
 */
@Getter
public class ParseException extends RuntimeException {

    private final int tokenIndex;
    private final Token token;

    public ParseException(String message, int tokenIndex) {
        super(message);
        this.tokenIndex = tokenIndex;
        this.token = null;
    }

    public ParseException(Token token, String expected) {
        super(String.format("Expected %s but found '%s' at token %d", expected, token.lexeme(), token.index()));
        this.tokenIndex = token.index();
        this.token = token;
    }

    public ParseException(String message, Token token) {
        super(message);
        this.tokenIndex = token.index();
        this.token = token;
    }
}
