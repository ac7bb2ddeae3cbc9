package com.chirpy.api.web;

import com.chirpy.api.error.ForbiddenException;
import com.chirpy.api.users.UserService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin")
class AdminController {

  private static final Logger log = LoggerFactory.getLogger(AdminController.class);

  private static final String METRICS_PAGE = """
      <html>
        <body>
          <h1>Welcome, Chirpy Admin</h1>
          <p>Chirpy has been visited %d times!</p>
        </body>
      </html>
      """;

  private final HitCounter hitCounter;
  private final UserService userService;
  private final String platform;

  AdminController(HitCounter hitCounter, UserService userService, @Value("${app.platform:prod}") String platform) {
    this.hitCounter = hitCounter;
    this.userService = userService;
    this.platform = platform;
  }

  @GetMapping(value = "/metrics", produces = MediaType.TEXT_HTML_VALUE)
  String metrics() {
    return METRICS_PAGE.formatted(hitCounter.get());
  }

  /** Development only: zeroes the hit counter and wipes all users. */
  @PostMapping("/reset")
  ResponseEntity<String> reset() {
    if (!"dev".equals(platform)) {
      throw new ForbiddenException("Reset is only allowed in development mode");
    }
    hitCounter.reset();
    userService.deleteAll();
    log.warn("Hit counter and user table reset");
    return ResponseEntity.ok().contentType(MediaType.TEXT_PLAIN).body("Hits counter and user table reset");
  }
}
