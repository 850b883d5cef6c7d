package com.example.bulkfile.model;

public enum IdentitySource {
    DIRECTORY,
    FALLBACK_GROUP,
    DEFAULT
}
