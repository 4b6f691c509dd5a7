/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.internal;

/**
 * Marks a field, parameter or return value that may be null. Tools process any annotation named
 * {@code Nullable}, so this avoids a dependency on a jsr305 jar.
 */
@java.lang.annotation.Documented
@java.lang.annotation.Retention(java.lang.annotation.RetentionPolicy.RUNTIME)
public @interface Nullable {
}
