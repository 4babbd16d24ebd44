package io.intellixity.vecta.query;

public enum Logic { AND, OR, NOT }
