package io.intellixity.vecta.schema;

public enum MetadataType { STRING, INT, FLOAT, BOOL, STRING_ARRAY, INT_ARRAY, GEO }
