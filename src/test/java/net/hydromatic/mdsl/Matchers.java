/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.mdsl;

import net.hydromatic.mdsl.compile.Severity;
import net.hydromatic.mdsl.compile.ValidationIssue;
import net.hydromatic.mdsl.compile.ValidationResult;
import net.hydromatic.mdsl.util.MdslException;

import org.hamcrest.CustomTypeSafeMatcher;
import org.hamcrest.Matcher;

import java.util.List;

/** Matchers for use in MediaLanguage tests. */
public abstract class Matchers {
  private Matchers() {}

  /** Matches a throwable whose string form contains a given message. */
  public static Matcher<Throwable> throwsA(String message) {
    return new CustomTypeSafeMatcher<Throwable>("throwable: " + message) {
      @Override protected boolean matchesSafely(Throwable item) {
        return item.toString().contains(message);
      }
    };
  }

  public static <T extends Throwable> Matcher<Throwable> throwsA(
      Class<T> clazz, Matcher<?> messageMatcher) {
    return new CustomTypeSafeMatcher<Throwable>(clazz + " with message "
        + messageMatcher) {
      @Override protected boolean matchesSafely(Throwable item) {
        return clazz.isInstance(item)
            && messageMatcher.matches(item.getMessage());
      }
    };
  }

  /** Matches an {@link MdslException} whose description, including the
   * phase prefix, is a given string. */
  public static Matcher<Throwable> describedAs(String description) {
    return new CustomTypeSafeMatcher<Throwable>("exception described as "
        + description) {
      @Override protected boolean matchesSafely(Throwable item) {
        return item instanceof MdslException
            && ((MdslException) item).describeTo(new StringBuilder())
                .toString().equals(description);
      }
    };
  }

  /** Matches a validation result with given numbers of errors and
   * warnings. */
  public static Matcher<ValidationResult> hasCounts(int errors,
      int warnings) {
    return new CustomTypeSafeMatcher<ValidationResult>("result with "
        + errors + " errors and " + warnings + " warnings") {
      @Override protected boolean matchesSafely(ValidationResult item) {
        return item.errors == errors && item.warnings == warnings;
      }
    };
  }

  /** Matches a validation result that has exactly one issue with a given
   * code, and that issue has the given severity. */
  public static Matcher<ValidationResult> hasIssue(Severity severity,
      String code) {
    return new CustomTypeSafeMatcher<ValidationResult>("result with one "
        + severity + " " + code) {
      @Override protected boolean matchesSafely(ValidationResult item) {
        final List<ValidationIssue> issues = item.issues(code);
        return issues.size() == 1 && issues.get(0).severity == severity;
      }
    };
  }

  /** Matches a validation result that has no issue with a given code. */
  public static Matcher<ValidationResult> hasNoIssue(String code) {
    return new CustomTypeSafeMatcher<ValidationResult>("result without "
        + code) {
      @Override protected boolean matchesSafely(ValidationResult item) {
        return item.issues(code).isEmpty();
      }
    };
  }

  /** Matches a string that contains a given substring exactly {@code n}
   * times. */
  public static Matcher<String> containsTimes(String substring, int n) {
    return new CustomTypeSafeMatcher<String>("string containing '"
        + substring + "' " + n + " times") {
      @Override protected boolean matchesSafely(String item) {
        return count(item, substring) == n;
      }
    };
  }

  /** Returns the number of non-overlapping occurrences of a substring. */
  public static int count(String s, String substring) {
    int n = 0;
    for (int i = s.indexOf(substring); i >= 0;
         i = s.indexOf(substring, i + substring.length())) {
      ++n;
    }
    return n;
  }
}

// End Matchers.java
