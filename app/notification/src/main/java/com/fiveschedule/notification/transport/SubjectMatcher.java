package com.fiveschedule.notification.transport;

final class SubjectMatcher {

  private SubjectMatcher() {}

  static boolean matches(String pattern, String subject) {
    String[] patternTokens = pattern.split("\\.", -1);
    String[] subjectTokens = subject.split("\\.", -1);
    for (int i = 0; i < patternTokens.length; i++) {
      String token = patternTokens[i];
      if (">".equals(token)) {
        return subjectTokens.length > i;
      }
      if (i >= subjectTokens.length) {
        return false;
      }
      if (!"*".equals(token) && !token.equals(subjectTokens[i])) {
        return false;
      }
    }
    return patternTokens.length == subjectTokens.length;
  }
}
