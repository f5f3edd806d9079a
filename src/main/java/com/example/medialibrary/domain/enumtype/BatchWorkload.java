package com.example.medialibrary.domain.enumtype;

public enum BatchWorkload {
    /** File reads, container probes, picture extraction. */
    IO,
    /** In-memory computation such as merging. */
    CPU
}
