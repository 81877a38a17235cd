package com.lexgate.core.engine;

import com.lexgate.core.apply.ApplyResult;
import com.lexgate.core.model.GateDecision;
import com.lexgate.core.model.TaskPacket;
import com.lexgate.core.propose.ProposalBatch;
import com.lexgate.core.scanner.ScanResult;
import com.lexgate.core.verify.VerifyReport;

import java.util.List;

/**
 * Everything one pipeline run produced, stage by stage.
 *
 * @param rescan findings left after patching, the input to the gate
 * @param gate   null when the run stopped before gating
 */
public record RunReport(
        String runId,
        ScanResult scan,
        ProposalBatch proposals,
        ApplyResult applied,
        List<TaskPacket> tasks,
        VerifyReport verify,
        ScanResult rescan,
        GateDecision gate
) {

    public RunReport {
        tasks = List.copyOf(tasks);
    }
}
