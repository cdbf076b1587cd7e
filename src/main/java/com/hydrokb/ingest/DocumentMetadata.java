package com.hydrokb.ingest;

import java.util.List;

public record DocumentMetadata(
        List<String> keywords,
        List<String> formulas,
        List<String> tables,
        List<String> figures,
        List<String> examples,
        List<String> references,
        String language) {

    public DocumentMetadata {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        formulas = formulas == null ? List.of() : List.copyOf(formulas);
        tables = tables == null ? List.of() : List.copyOf(tables);
        figures = figures == null ? List.of() : List.copyOf(figures);
        examples = examples == null ? List.of() : List.copyOf(examples);
        references = references == null ? List.of() : List.copyOf(references);
        language = language == null || language.isBlank() ? "es" : language;
    }

    public static DocumentMetadata empty(String language) {
        return new DocumentMetadata(List.of(), List.of(), List.of(), List.of(), List.of(), List.of(), language);
    }
}
