package com.hydrokb;

public record FormulaReference(String documentId, String title, String category, String subcategory, String formula) {
}
