package com.storyforge.backend.shared.json;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Closes a JSON document that was cut off mid-way, typically by an output token limit. Pure and
 * heuristic: it only appends what is missing at the end (a closing quote and the closing brackets
 * of every container still open) and never rewrites what was already there.
 */
public final class JsonRepair {

  private JsonRepair() {}

  public static String repair(String json) {
    if (json == null) {
      return "";
    }
    String text = json.strip();
    Deque<Character> open = new ArrayDeque<>();
    boolean inString = false;
    boolean escaped = false;
    for (int i = 0; i < text.length(); i++) {
      char ch = text.charAt(i);
      if (inString) {
        if (escaped) {
          escaped = false;
        } else if (ch == '\\') {
          escaped = true;
        } else if (ch == '"') {
          inString = false;
        }
        continue;
      }
      switch (ch) {
        case '"' -> inString = true;
        case '{' -> open.push('}');
        case '[' -> open.push(']');
        case '}', ']' -> {
          if (!open.isEmpty() && open.peek() == ch) {
            open.pop();
          }
        }
        default -> {}
      }
    }

    StringBuilder repaired = new StringBuilder(text);
    if (inString) {
      if (escaped) {
        repaired.setLength(repaired.length() - 1);
      }
      repaired.append('"');
    } else {
      trimDanglingSeparator(repaired);
    }
    while (!open.isEmpty()) {
      repaired.append(open.pop());
    }
    return repaired.toString();
  }

  private static void trimDanglingSeparator(StringBuilder text) {
    int end = text.length();
    while (end > 0 && Character.isWhitespace(text.charAt(end - 1))) {
      end--;
    }
    if (end == 0) {
      return;
    }
    char last = text.charAt(end - 1);
    if (last == ',') {
      text.setLength(end - 1);
    } else if (last == ':') {
      text.setLength(end);
      text.append("null");
    }
  }
}
