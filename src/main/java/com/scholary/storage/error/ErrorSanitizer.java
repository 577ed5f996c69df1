package com.scholary.storage.error;

import java.util.List;
import java.util.regex.Pattern;

/** Removes credentials from messages before they are logged or handed back to callers. */
public final class ErrorSanitizer {

  private record Rule(Pattern pattern, String replacement) {}

  private static final List<Rule> RULES =
      List.of(
          new Rule(
              Pattern.compile("access.?key.?id[:\\s=]*[a-zA-Z0-9]+", Pattern.CASE_INSENSITIVE),
              "access_key_id=***"),
          new Rule(
              Pattern.compile(
                  "secret.?access.?key[:\\s=]*[a-zA-Z0-9/+=]+", Pattern.CASE_INSENSITIVE),
              "secret_access_key=***"),
          new Rule(
              Pattern.compile("password[:\\s=]*\\S+", Pattern.CASE_INSENSITIVE), "password=***"),
          new Rule(
              Pattern.compile("token[:\\s=]*[a-zA-Z0-9/+=]+", Pattern.CASE_INSENSITIVE),
              "token=***"),
          // presigned query parameters
          new Rule(
              Pattern.compile("(X-Amz-(?:Signature|Credential|Security-Token))=[^&\\s]+"),
              "$1=***"));

  private ErrorSanitizer() {}

  public static String sanitize(String message) {
    if (message == null || message.isEmpty()) {
      return message;
    }
    String result = message;
    for (Rule rule : RULES) {
      result = rule.pattern().matcher(result).replaceAll(rule.replacement());
    }
    return result;
  }
}
