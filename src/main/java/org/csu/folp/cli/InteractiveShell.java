package org.csu.folp.cli;

import lombok.Getter;
import org.csu.folp.engine.FormulaProcessor;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.Locale;

/**
 * 交互式命令行：每行一条公式。
 * <ul>
 *   <li>exit / quit 退出</li>
 *   <li>source &lt;path&gt; 执行脚本文件，空行和以 # 开头的行被忽略</li>
 *   <li>tokens on|off 切换是否打印Token流</li>
 * </ul>
 */
public class InteractiveShell {

    private static final String PROMPT = "fol> ";

    private final FormulaProcessor processor;
    private final PrintStream out;
    private final PrintStream err;
    @Getter
    private boolean echoTokens;

    public InteractiveShell(FormulaProcessor processor, PrintStream out, PrintStream err, boolean echoTokens) {
        this.processor = processor;
        this.out = out;
        this.err = err;
        this.echoTokens = echoTokens;
    }

    public void run(BufferedReader in) throws IOException {
        out.println("FOL formula parser. Type 'exit' to quit.");
        while (true) {
            out.print(PROMPT);
            out.flush();
            String line = in.readLine();
            if (line == null) {
                break;
            }
            String command = line.trim();
            if (command.isEmpty()) {
                continue;
            }
            if (command.equalsIgnoreCase("exit") || command.equalsIgnoreCase("quit")) {
                break;
            }
            if (command.toLowerCase(Locale.ROOT).startsWith("source ")) {
                executeFile(command.substring("source".length()).trim());
                continue;
            }
            if (command.equalsIgnoreCase("tokens on") || command.equalsIgnoreCase("tokens off")) {
                echoTokens = command.toLowerCase(Locale.ROOT).endsWith("on");
                out.println("Token echo " + (echoTokens ? "enabled." : "disabled."));
                continue;
            }
            execute(command);
        }
        out.println("Bye!");
    }

    /**
     * 逐行解析脚本。文件不存在或读取失败时在 err 上报告并返回 false。
     */
    public boolean executeFile(String filePath) {
        File scriptFile = new File(filePath);
        if (!scriptFile.exists()) {
            err.println("ERROR: File not found: " + scriptFile.getAbsolutePath());
            return false;
        }
        out.println("Executing formula script from: " + filePath);
        try {
            List<String> lines = Files.readAllLines(scriptFile.toPath(), StandardCharsets.UTF_8);
            for (String line : lines) {
                String formula = line.trim();
                if (formula.isEmpty() || formula.startsWith("#")) {
                    continue;
                }
                execute(formula);
            }
            out.println("Finished executing script.");
            return true;
        } catch (IOException e) {
            err.println("Error reading file: " + e.getMessage());
            return false;
        }
    }

    public void execute(String formula) {
        out.println("Parsing: " + formula);
        if (echoTokens) {
            out.println("  Tokens: " + processor.tokenize(formula));
        }
        for (String resultLine : processor.executeAndGetResult(formula).split("\n")) {
            out.println("  " + resultLine);
        }
        out.println("-".repeat(20));
    }
}
