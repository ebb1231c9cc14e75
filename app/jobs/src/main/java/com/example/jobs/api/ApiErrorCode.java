package com.example.jobs.api;

public enum ApiErrorCode {
  BAD_REQUEST
}
