package org.csu.folp.compiler.parser.ast;

import java.util.regex.Pattern;

/**
 * 标识符形状校验。AST节点可以脱离Token单独构造，所以在构造时再校验一次。
 */
final class Identifiers {

    private static final Pattern LOWER = Pattern.compile("[a-z][a-z0-9]*");
    private static final Pattern UPPER = Pattern.compile("[A-Z][A-Z0-9]*");

    private Identifiers() {
    }

    static String requireLower(String name, String what) {
        if (name == null || !LOWER.matcher(name).matches()) {
            throw new IllegalArgumentException(what + " name must match [a-z][a-z0-9]*, got '" + name + "'");
        }
        return name;
    }

    static String requireUpper(String name, String what) {
        if (name == null || !UPPER.matcher(name).matches()) {
            throw new IllegalArgumentException(what + " name must match [A-Z][A-Z0-9]*, got '" + name + "'");
        }
        return name;
    }
}
