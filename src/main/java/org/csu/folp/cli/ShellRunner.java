package org.csu.folp.cli;

import org.csu.folp.engine.FormulaProcessor;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * 程序入口。根据 {@link ShellOptions} 选择演示、脚本或交互模式。
 */
public class ShellRunner {

    static final List<String> DEMO_FORMULAS = List.of(
            "forall x. (P(x) -> Q(x, A))",
            "exists y. ~(P(y) & Q(y))",
            "( (forall x. P(x)) | (exists y. Q(y)) )",
            "R(B, z)",
            // 缺少 '.'，预期失败
            "forall x P(x)"
    );

    public static void main(String[] args) throws IOException {
        ShellOptions options;
        try {
            options = ShellOptions.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println("Usage: ShellRunner [--demo | --file <path>] [--tokens]");
            System.exit(2);
            return;
        }
        int status = run(options, new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
        if (status != 0) {
            System.exit(status);
        }
    }

    static int run(ShellOptions options, BufferedReader in) throws IOException {
        InteractiveShell shell = new InteractiveShell(new FormulaProcessor(), System.out, System.err, options.isEchoTokens());
        switch (options.getMode()) {
            case DEMO:
                DEMO_FORMULAS.forEach(shell::execute);
                return 0;
            case FILE:
                return shell.executeFile(options.getScriptPath()) ? 0 : 1;
            default:
                shell.run(in);
                return 0;
        }
    }
}
