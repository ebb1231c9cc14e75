/*
 * Where: jobs API
 * What: raise events, trigger processing and read job health over HTTP
 * Why: producers outside the process and operators use the same engine as in-process callers
 */
package com.example.jobs.api;

import com.example.jobs.model.Event;
import com.example.jobs.service.JobEngine;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/jobs")
@RequiredArgsConstructor
public class JobController {

  private final JobEngine jobEngine;

  @PutMapping("/events/{type}")
  public ResponseEntity<Void> raiseEvent(
      @PathVariable("type") String type,
      @RequestParam(value = "resource", required = false) String resource,
      @RequestParam(value = "resource_id", required = false) UUID resourceId,
      @RequestBody(required = false) JsonNode payload) {
    Event event = Event.of(type, resource, resourceId);
    if (payload != null && !payload.isNull()) {
      event = event.withPayload(payload.toString());
    }
    jobEngine.raiseEvent(event);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/process")
  public ResponseEntity<Void> process() {
    jobEngine.processJobs();
    return ResponseEntity.accepted().build();
  }

  @GetMapping("/health")
  public JobHealthResponse health(
      @RequestParam(value = "details", defaultValue = "false") boolean details) {
    return JobHealthResponse.from(jobEngine.health(details));
  }
}
