/*
 * Where: jobs domain model
 * What: lifecycle state of a row in the jobs table
 * Why: keep the claim SQL and the dispatcher on the same vocabulary
 */
package com.example.jobs.model;

public enum JobStatus {
  PENDING,
  PROCESSING,
  FAILED
}
