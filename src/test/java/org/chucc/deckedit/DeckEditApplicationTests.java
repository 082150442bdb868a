package org.chucc.deckedit;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

/**
 * Basic application context test.
 */
@SpringBootTest
@ActiveProfiles("test")
class DeckEditApplicationTests {

  @Test
  void contextLoads() {
    // This test verifies that the application context loads successfully
  }
}
