package com.example.dataflow.core.model;

public enum RefreshStatus {
    OK,
    ERROR
}
