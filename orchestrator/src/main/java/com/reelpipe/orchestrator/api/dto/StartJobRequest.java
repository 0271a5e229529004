package com.reelpipe.orchestrator.api.dto;

import com.reelpipe.orchestrator.model.JobKind;
import com.reelpipe.orchestrator.model.JobPolicy;
import com.reelpipe.orchestrator.model.RejectAction;
import com.reelpipe.orchestrator.service.JobRequest;
import com.reelpipe.orchestrator.service.PlanOptions;

/**
 * Request body for POST /jobs.
 *
 * Example:
 * <pre>
 * {"kind":"DOCUMENT_AUTORUN","projectRef":"proj-42","format":"documentary",
 *  "policy":{"maxItemsPerTick":1,"stopOnFirstFail":false},
 *  "options":{"approvalStages":["concept_brief"]}}
 * </pre>
 */
public record StartJobRequest(
        JobKind       kind,
        String        projectRef,
        String        format,
        PolicyRequest policy,
        PlanOptions   options
) {
    /** All fields optional; missing ones take the defaults of {@link JobPolicy#defaults()}. */
    public record PolicyRequest(Boolean autoApprove, Boolean stopOnFirstFail,
                                Integer maxItemsPerTick, RejectAction rejectAction) {

        JobPolicy toPolicy() {
            return new JobPolicy(
                    Boolean.TRUE.equals(autoApprove),
                    Boolean.TRUE.equals(stopOnFirstFail),
                    maxItemsPerTick == null ? 1 : maxItemsPerTick,
                    rejectAction);
        }
    }

    public JobRequest toJobRequest() {
        return new JobRequest(kind, projectRef, format,
                policy == null ? JobPolicy.defaults() : policy.toPolicy(), options);
    }
}
