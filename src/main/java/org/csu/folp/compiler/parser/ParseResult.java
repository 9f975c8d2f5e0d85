package org.csu.folp.compiler.parser;

import org.csu.folp.compiler.parser.ast.FormulaNode;

import java.util.Objects;

/**
 * 解析结果：要么是一个公式，要么是一个 {@link ParseError}。没有部分成功。
 */
public sealed interface ParseResult permits ParseResult.Success, ParseResult.Failure {

    record Success(FormulaNode formula) implements ParseResult {
        public Success {
            Objects.requireNonNull(formula, "formula");
        }
    }

    record Failure(ParseError error) implements ParseResult {
        public Failure {
            Objects.requireNonNull(error, "error");
        }
    }

    static ParseResult success(FormulaNode formula) {
        return new Success(formula);
    }

    static ParseResult failure(ParseError error) {
        return new Failure(error);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * @return 解析出的公式
     * @throws org.csu.folp.common.exception.ParseException 解析失败时抛出原错误
     */
    default FormulaNode orElseThrow() {
        if (this instanceof Success success) {
            return success.formula();
        }
        throw ((Failure) this).error().toException();
    }
}
