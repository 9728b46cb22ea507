package com.example.cvmatch.model;

public enum Priority {
    HIGH,
    MEDIUM
}
