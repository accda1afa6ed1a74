package com.jliquid;

import com.jliquid.output.OutputFormatter;
import com.jliquid.output.SliceReport;
import com.jliquid.parser.Parser;
import org.eclipse.collections.api.list.MutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.FileInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;

@Command(name = "jliquid", mixinStandardHelpOptions = true, version = "1.0",
         description = "Slice, lex and parse a Liquid template and print what the front end sees")
public class JLiquid implements Callable<Integer> {
    private static final Logger LOGGER = LoggerFactory.getLogger(JLiquid.class);

    @Parameters(index = "0", arity = "0..1", description = "Template file (default: stdin)")
    private File templateFile;

    @Option(names = {"-c", "--compact-output"}, description = "Compact output without whitespace")
    private boolean compactOutput = false;

    @Option(names = {"-s", "--strict"}, description = "Abort on the first lexical or syntax error")
    private boolean strict = false;

    @Option(names = {"--max-depth"}, description = "Maximum expression nesting depth (default: ${DEFAULT-VALUE})")
    private int maxDepth = Parser.DEFAULT_MAX_DEPTH;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new JLiquid()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        try {
            String template;
            try (InputStream input = templateFile != null ? new FileInputStream(templateFile) : System.in) {
                template = new String(input.readAllBytes(), StandardCharsets.UTF_8);
            }

            TemplateInspector inspector = new TemplateInspector(strict, maxDepth);
            MutableList<SliceReport> reports = inspector.inspect(template);

            OutputFormatter formatter = new OutputFormatter(!compactOutput);
            System.out.println(formatter.format(reports));

            return reports.anySatisfy(SliceReport::hasError) ? 2 : 0;
        } catch (Exception e) {
            LOGGER.debug("Inspection failed", e);
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
