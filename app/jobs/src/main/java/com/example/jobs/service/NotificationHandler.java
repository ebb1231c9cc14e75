package com.example.jobs.service;

import com.example.jobs.model.Notification;

/** Receives resource mutations synchronously on the mutating thread. */
@FunctionalInterface
public interface NotificationHandler {

  /**
   * Handles one mutation. The return value is reserved and currently ignored; a thrown exception is
   * logged and does not affect other listeners or the mutation itself.
   */
  boolean handle(Notification notification) throws Exception;
}
