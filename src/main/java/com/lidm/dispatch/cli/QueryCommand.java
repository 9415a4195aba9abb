package com.lidm.dispatch.cli;

import com.lidm.core.engine.DelegationManager;
import com.lidm.core.model.QueryResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: lidm query "&lt;text&gt;"
 * <p>
 * Runs one query through the delegation pipeline and prints the answer with
 * its classification, subtasks and confidence. Exit code 1 when the query failed.
 */
@Command(name = "query", mixinStandardHelpOptions = true, description = "Answer a natural-language query")
@Component
public class QueryCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Natural language query")
    private String query;

    @Option(names = {"--trace", "-t"}, description = "Print every backend call made for the query")
    private boolean showTrace;

    private final DelegationManager delegationManager;

    public QueryCommand(DelegationManager delegationManager) {
        this.delegationManager = delegationManager;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Routing query...");

        QueryResult result = delegationManager.handleQuery(query);

        if (result.classification() != null) {
            var c = result.classification();
            ConsoleOutput.info(String.format("Type: %s | Complexity: %.2f | Capabilities: %s",
                    c.taskType(), c.complexity(), String.join(", ", c.capabilities())));
        }
        if (result.strategy() != null) {
            ConsoleOutput.info("Strategy: " + result.strategy());
        }
        if (result.subtasks().size() > 1) {
            System.out.println();
            System.out.println("SUBTASKS:");
            result.subtasks().forEach(ConsoleOutput::subtask);
        }

        System.out.println();
        System.out.println("QUERY " + result.queryId());
        System.out.println(result.answer());
        System.out.println();

        if (showTrace && !result.trace().isEmpty()) {
            System.out.println("TRACE:");
            result.trace().forEach(ConsoleOutput::traceEntry);
            System.out.println();
        }

        System.out.println("──────────────────────────────────");
        if (result.succeeded()) {
            ConsoleOutput.confidence(result.confidence());
            ConsoleOutput.success("Done in " + ConsoleOutput.formatDuration(result.durationMs())
                    + " (" + result.trace().size() + " backend calls)");
            return 0;
        }
        ConsoleOutput.error("Query failed: " + result.error());
        return 1;
    }
}
