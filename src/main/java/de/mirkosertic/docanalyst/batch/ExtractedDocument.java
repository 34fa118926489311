package de.mirkosertic.docanalyst.batch;

import de.mirkosertic.docanalyst.model.PageText;

import java.util.List;

public record ExtractedDocument(
        List<PageText> pages,
        String fileType,
        long fileSize
) {

    public ExtractedDocument {
        pages = List.copyOf(pages);
    }
}
