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
package net.hydromatic.mdsl.util;

import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.function.Predicate;

/** Utilities. */
public class Static {
  private Static() {}

  /**
   * Formats a number the way the generated scripts expect.
   *
   * <p>Integral values have no fraction ("100", not "100.0"); other values
   * use the shortest decimal representation ("0.5", "12.75"), never
   * scientific notation.
   */
  public static String formatNumber(double d) {
    if (Double.isNaN(d) || Double.isInfinite(d)) {
      return Double.toString(d);
    }
    if (d == 0d) {
      return "0";
    }
    return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
  }

  /** Converts a number to an int if it is a whole number that fits in an
   * int; otherwise returns null. */
  public static @Nullable Integer toIntExact(@Nullable Double d) {
    if (d == null
        || d != Math.rint(d)
        || d < Integer.MIN_VALUE
        || d > Integer.MAX_VALUE) {
      return null;
    }
    return d.intValue();
  }

  /** Eagerly filters a Collection, returning the elements of a given class
   * that match a predicate. */
  public static <E, T extends E> ImmutableList<T> filterEager(
      Collection<? extends E> elements, Class<T> clazz,
      Predicate<? super T> predicate) {
    final ImmutableList.Builder<T> b = ImmutableList.builder();
    for (E e : elements) {
      if (clazz.isInstance(e) && predicate.test(clazz.cast(e))) {
        b.add(clazz.cast(e));
      }
    }
    return b.build();
  }

  /** Returns the elements of a collection that are instances of a given
   * class. */
  public static <E, T extends E> ImmutableList<T> filterEager(
      Collection<? extends E> elements, Class<T> clazz) {
    return filterEager(elements, clazz, e -> true);
  }

  /** Returns the first element of a list that is an instance of a given
   * class and matches a predicate, or null. */
  public static <E, T extends E> @Nullable T find(
      Collection<? extends E> elements, Class<T> clazz,
      Predicate<? super T> predicate) {
    for (E e : elements) {
      if (clazz.isInstance(e) && predicate.test(clazz.cast(e))) {
        return clazz.cast(e);
      }
    }
    return null;
  }
}

// End Static.java
