package org.csu.folp.cli;

import lombok.Getter;

/**
 * 命令行参数。
 * <pre>
 *   --demo           解析内置的示例公式
 *   --file &lt;path&gt;    逐行解析脚本文件
 *   --tokens         同时打印Token流
 * </pre>
 * 不带模式参数时进入交互式Shell。
 */
@Getter
public class ShellOptions {

    public enum Mode {
        INTERACTIVE,
        DEMO,
        FILE
    }

    private final Mode mode;
    private final String scriptPath;
    private final boolean echoTokens;

    public ShellOptions(Mode mode, String scriptPath, boolean echoTokens) {
        this.mode = mode;
        this.scriptPath = scriptPath;
        this.echoTokens = echoTokens;
    }

    public static ShellOptions parse(String... args) {
        Mode mode = Mode.INTERACTIVE;
        String scriptPath = null;
        boolean echoTokens = false;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--demo":
                    mode = Mode.DEMO;
                    break;
                case "--file":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("--file requires a path");
                    }
                    mode = Mode.FILE;
                    scriptPath = args[++i];
                    break;
                case "--tokens":
                    echoTokens = true;
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }
        return new ShellOptions(mode, scriptPath, echoTokens);
    }
}
