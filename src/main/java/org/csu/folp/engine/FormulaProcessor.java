package org.csu.folp.engine;

import org.csu.folp.compiler.lexer.Lexer;
import org.csu.folp.compiler.lexer.Token;
import org.csu.folp.compiler.parser.ParseError;
import org.csu.folp.compiler.parser.ParseResult;
import org.csu.folp.compiler.parser.Parser;
import org.csu.folp.compiler.parser.ast.FormulaNode;
import org.csu.folp.compiler.printer.FormulaPrinter;

import java.util.List;

/**
 * @author hidyouth
 * @description: 公式处理的统一入口。
 *
 * 串起 词法分析 -&gt; 语法分析 -&gt; 结果格式化。本类没有可变状态，可以在多个线程间共享。
 */
public class FormulaProcessor {

    public List<Token> tokenize(String text) {
        return new Lexer(text).tokenize();
    }

    /**
     * 解析一条公式，任何输入都不会抛出异常。
     */
    public ParseResult parse(String text) {
        return Parser.parse(text);
    }

    /**
     * 解析并返回可直接打印的结果字符串。
     */
    public String executeAndGetResult(String text) {
        ParseResult result = parse(text);
        if (result instanceof ParseResult.Success success) {
            FormulaNode formula = success.formula();
            return "Result: " + FormulaPrinter.render(formula) + "\n"
                    + "Type: " + FormulaPrinter.kindOf(formula);
        }
        ParseError error = ((ParseResult.Failure) result).error();
        return "Error: " + error.message() + "\n" + caretLine(text, error);
    }

    /**
     * 在出错的那一行下方用 '^' 标出位置；输入提前结束时指向文本末尾。
     * 多行输入只显示出错的那一行，制表符原样复制到缩进里以保证对齐。
     */
    static String caretLine(String text, ParseError error) {
        String source = text == null ? "" : text;
        int offset = error.isEndOfInput() ? source.stripTrailing().length() : error.token().offset();
        int lineStart = source.lastIndexOf('\n', offset - 1) + 1;
        int lineEnd = source.indexOf('\n', offset);
        if (lineEnd < 0) {
            lineEnd = source.length();
        }
        String line = source.substring(lineStart, lineEnd);
        if (line.endsWith("\r")) {
            line = line.substring(0, line.length() - 1);
        }
        StringBuilder padding = new StringBuilder();
        for (int i = lineStart; i < offset; i++) {
            padding.append(source.charAt(i) == '\t' ? '\t' : ' ');
        }
        return "  " + line + "\n  " + padding + "^";
    }
}
