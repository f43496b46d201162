package com.example.iptvcatalog.domain.model;

import lombok.Value;

@Value
public class ParseError {

    /** 1-based; 0 when the error is not tied to a line (e.g. download failure). */
    int lineNumber;

    String rawLine;

    String reason;
}
