package com.deepansh.memory.decision;

import com.deepansh.memory.model.CandidateFact;
import com.deepansh.memory.model.MemoryDecision;
import com.deepansh.memory.model.SimilarRecord;

import java.util.List;

/**
 * Proposes what to do with one candidate given the owner's similar active records.
 * Implementations are advisory; the engine validates every proposal.
 */
public interface DecisionClient {

    /**
     * @throws com.deepansh.memory.exception.DecisionUnavailableException the collaborator could not be reached
     */
    MemoryDecision decide(CandidateFact candidate, List<SimilarRecord> similar);
}
