package com.kubegraph.dispatch.cli;

import com.kubegraph.core.expression.CompileError;
import com.kubegraph.core.expression.CompileOptions;
import com.kubegraph.core.expression.CompileResult;
import com.kubegraph.core.expression.CompileTarget;
import com.kubegraph.core.expression.Diagnostic;
import com.kubegraph.core.expression.ExpressionCompiler;
import com.kubegraph.core.expression.ExpressionContext;
import com.kubegraph.core.expression.SourceMapping;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: kubegraph compile "&lt;expression&gt;"
 * <p>
 * Compiles an expression to CEL and prints the result, diagnostics and source map.
 */
@Command(name = "compile", mixinStandardHelpOptions = true, description = "Compile an expression to CEL")
@Component
public class CompileCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Expression, e.g. resources.web.status.readyReplicas > 0")
    private String expression;

    @Option(names = "--context", description = "Validation context: boolean, status or any", defaultValue = "any")
    private String context;

    @Option(names = "--strict", description = "Treat diagnostics as errors")
    private boolean strict;

    @Option(names = "--source-map", description = "Print the source map")
    private boolean sourceMap;

    private final ExpressionCompiler compiler;

    public CompileCommand(ExpressionCompiler compiler) {
        this.compiler = compiler;
    }

    @Override
    public Integer call() {
        ExpressionContext expressionContext;
        try {
            expressionContext = ExpressionContext.parse(context);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid context: " + context + ". Valid contexts: boolean, status, any");
            return 2;
        }

        CompileResult result;
        try {
            result = compiler.compileText(expression, CompileTarget.CEL, new CompileOptions(expressionContext, strict));
        } catch (CompileError e) {
            ConsoleOutput.error("[" + e.code() + "] " + e.getMessage());
            return 1;
        }

        if (!result.requiresConversion()) {
            ConsoleOutput.info("No references; value is unchanged");
            System.out.println(result.resultValue());
            return 0;
        }
        System.out.println(result.compiledExpression().expressionText());
        ConsoleOutput.info("References: " + String.join(", ", result.referencedResourceIds()));
        for (Diagnostic diagnostic : result.diagnostics()) {
            ConsoleOutput.warn("[" + diagnostic.code() + "] " + diagnostic.message());
        }
        if (sourceMap) {
            for (SourceMapping mapping : result.sourceMap()) {
                System.out.println("    " + mapping.sourceText() + "  ->  " + mapping.emittedText());
            }
        }
        return 0;
    }
}
