package com.evidencevault.vault;

import com.evidencevault.classification.ClassificationContext;

/**
 * Inbound content offered for capture. The reported subject is the sender in
 * {@code context}.
 *
 * @param caseId     legal case the content belongs to; null derives one from reporter and subject
 * @param capturedBy actor triggering the capture (reporting user or system id)
 */
public record CaptureRequest(
        String content,
        EvidenceKind kind,
        String caseId,
        String reporterId,
        String capturedBy,
        ClassificationContext context
) {}
