package com.example.jobs.service;

import com.example.jobs.model.Event;

/** Processes one event. Throwing marks the attempt as failed and schedules a retry. */
@FunctionalInterface
public interface JobHandler {

  void handle(Event event) throws Exception;
}
