package com.actionplan.taskimport.diagnostics;

public record ImportSummary(int dataRows, int accepted, int skippedEmpty, int rejected, int warnings) {}
