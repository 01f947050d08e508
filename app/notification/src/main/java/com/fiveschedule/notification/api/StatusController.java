/*
 * Where: notification API
 * What: plain liveness text at the root path
 */
package com.fiveschedule.notification.api;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatusController {

  @GetMapping("/")
  public String home() {
    return "notification: ok";
  }
}
