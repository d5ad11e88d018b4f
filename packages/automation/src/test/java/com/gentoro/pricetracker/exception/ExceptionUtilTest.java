package com.gentoro.pricetracker.exception;

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import org.junit.jupiter.api.Test;

class ExceptionUtilTest {

  @Test
  void messageIsTakenFromTheUnwrappedCause() {
    Exception wrapped =
        new ExecutionException(new CompletionException(new IllegalStateException("boom")));
    assertEquals("boom", ExceptionUtil.extractErrorMessage(wrapped));
    assertTrue(ExceptionUtil.unwrap(wrapped) instanceof IllegalStateException);
  }

  @Test
  void missingMessageFallsBackToClassName() {
    assertEquals(
        "NullPointerException", ExceptionUtil.extractErrorMessage(new NullPointerException()));
    assertEquals("Unknown error", ExceptionUtil.extractErrorMessage(null));
  }

  @Test
  void compactStackTrace() {
    Exception e = new RuntimeException("x");
    String trace = ExceptionUtil.formatCompactStackTrace(e, 2);
    assertTrue(trace.startsWith(ExceptionUtilTest.class.getName() + ".compactStackTrace ("));
    assertEquals(1, trace.split(" > ").length - 1);
    assertEquals("", ExceptionUtil.formatCompactStackTrace(null));
  }

  @Test
  void contextIsRenderedInToString() {
    PriceTrackerException e = new StateException("not running").with("job", "quick_check");
    assertEquals(PriceTrackerErrorCode.STATE_ERROR, e.getCode());
    assertEquals("quick_check", e.getContext().get("job"));
    assertTrue(e.toString().contains("{job=quick_check}"));
  }
}
