package com.company.reporting.service;

import com.company.reporting.domain.ReportExecution;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.concurrent.CompletableFuture;

/**
 * A triggered execution as seen at trigger time, plus the future of its final state.
 * The future always completes normally, FAILED runs included.
 */
@Getter
@AllArgsConstructor
public class ExecutionHandle {

    private final ReportExecution execution;
    private final CompletableFuture<ReportExecution> completion;

    public static ExecutionHandle completed(ReportExecution execution) {
        return new ExecutionHandle(execution, CompletableFuture.completedFuture(execution));
    }

    public ReportExecution await() {
        return completion.join();
    }
}
