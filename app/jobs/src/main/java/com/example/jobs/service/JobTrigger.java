package com.example.jobs.service;

/**
 * Requests a processing round. Implementations coalesce requests: calling {@code fire} while a
 * request is already pending has no additional effect, and it never blocks the caller.
 */
public interface JobTrigger {

  void fire();
}
