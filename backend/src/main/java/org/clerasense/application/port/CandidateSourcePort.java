package org.clerasense.application.port;

import java.util.List;

/** Paged list of drug names worth ingesting ahead of demand. */
public interface CandidateSourcePort {
    List<String> page(int offset, int limit);
}
