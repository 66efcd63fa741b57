package com.deepansh.memory.extraction;

import com.deepansh.memory.model.CandidateFact;

import java.util.List;

/**
 * Raw observation text -> candidate facts. Performs no writes.
 *
 * Best-effort: implementations return an empty list when the collaborator is
 * unavailable or answers with something unparsable, and never throw.
 */
public interface FactExtractor {

    List<CandidateFact> extract(String text, List<String> knownEntities);
}
