package org.csu.folp.compiler.parser;

import org.csu.folp.common.exception.ParseException;
import org.csu.folp.compiler.lexer.Token;

/**
 * 一次失败的解析。
 *
 * @param message 可读的错误描述
 * @param tokenIndex 检测到错误的Token下标；输入提前结束时为Token总数
 * @param token 出错的Token，输入提前结束时为 null
 */
public record ParseError(String message, int tokenIndex, Token token) {

    public static ParseError from(ParseException e) {
        return new ParseError(e.getMessage(), e.getTokenIndex(), e.getToken());
    }

    public boolean isEndOfInput() {
        return token == null;
    }

    public ParseException toException() {
        return token == null
                ? new ParseException(message, tokenIndex)
                : new ParseException(message, token);
    }
}
