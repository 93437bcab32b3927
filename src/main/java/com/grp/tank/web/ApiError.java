package com.grp.tank.web;

import lombok.Value;

import java.time.Instant;

@Value
public class ApiError {
    int status;
    String error;
    String message;
    Instant timestamp;
}
