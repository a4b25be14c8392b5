package io.certcsi.observer.collector;

/**
 * Nothing was observed under the requested test case or run name.
 */
public class RunNotFoundException extends RuntimeException {

  public RunNotFoundException(String message) {
    super(message);
  }

  static RunNotFoundException forTestCase(long testCaseId) {
    return new RunNotFoundException("No entities recorded for test case " + testCaseId);
  }

  static RunNotFoundException forRun(String runName) {
    return new RunNotFoundException("No test run named " + runName);
  }
}
