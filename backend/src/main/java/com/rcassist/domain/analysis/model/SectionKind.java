package com.rcassist.domain.analysis.model;

public enum SectionKind {
    NARRATIVE,
    TABLE,
    LIST
}
