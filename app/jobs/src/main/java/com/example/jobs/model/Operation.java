package com.example.jobs.model;

public enum Operation {
  CREATE,
  UPDATE,
  DELETE
}
