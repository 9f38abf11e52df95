package com.slack.querier.model;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Strings;
import com.google.common.escape.Escaper;
import com.google.common.escape.Escapers;
import java.util.Objects;

/** A single label matcher of a stream selector, for example {@code app=~"api.*"}. */
public class LabelMatcher {

  public enum Type {
    EQUAL("="),
    NOT_EQUAL("!="),
    REGEX_MATCH("=~"),
    REGEX_NO_MATCH("!~");

    private final String operator;

    Type(String operator) {
      this.operator = operator;
    }

    public String operator() {
      return operator;
    }
  }

  private static final Escaper VALUE_ESCAPER =
      Escapers.builder()
          .addEscape('\\', "\\\\")
          .addEscape('"', "\\\"")
          .addEscape('\n', "\\n")
          .addEscape('\r', "\\r")
          .addEscape('\t', "\\t")
          .build();

  public final String name;
  public final Type type;
  public final String value;

  public LabelMatcher(String name, Type type, String value) {
    checkArgument(!Strings.isNullOrEmpty(name), "name can't be null or empty");
    checkArgument(type != null, "type can't be null");
    this.name = name;
    this.type = type;
    this.value = Strings.nullToEmpty(value);
  }

  public static LabelMatcher equal(String name, String value) {
    return new LabelMatcher(name, Type.EQUAL, value);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    LabelMatcher that = (LabelMatcher) o;
    return name.equals(that.name) && type == that.type && value.equals(that.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, type, value);
  }

  @Override
  public String toString() {
    return name + type.operator() + '"' + VALUE_ESCAPER.escape(value) + '"';
  }
}
