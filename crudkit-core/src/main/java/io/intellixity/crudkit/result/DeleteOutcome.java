package io.intellixity.crudkit.result;

public record DeleteOutcome(long deletedCount) {}
