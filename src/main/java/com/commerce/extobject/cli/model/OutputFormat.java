package com.commerce.extobject.cli.model;

public enum OutputFormat {
    JSON,
    MARKDOWN
}
