/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.query;

import pipelens.ValidationException;

/** A 1-based page number and the count of items per page. */
// @Immutable
public final class PageRequest {
  public static final int DEFAULT_PAGE_SIZE = 10;
  public static final PageRequest DEFAULT = new PageRequest(1, DEFAULT_PAGE_SIZE);

  /**
   * @throws ValidationException if page or page size are less than one
   */
  public static PageRequest create(int page, int pageSize) {
    if (page < 1) throw new ValidationException("page must be at least 1: " + page);
    if (pageSize < 1) throw new ValidationException("pageSize must be at least 1: " + pageSize);
    return new PageRequest(page, pageSize);
  }

  final int page, pageSize;

  PageRequest(int page, int pageSize) {
    this.page = page;
    this.pageSize = pageSize;
  }

  public int page() {
    return page;
  }

  public int pageSize() {
    return pageSize;
  }

  /** Index of the first item on this page. */
  public long offset() {
    return (long) (page - 1) * pageSize;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof PageRequest)) return false;
    PageRequest that = (PageRequest) o;
    return page == that.page && pageSize == that.pageSize;
  }

  @Override public int hashCode() {
    return (1000003 ^ page) * 1000003 ^ pageSize;
  }

  @Override public String toString() {
    return "PageRequest{page=" + page + ", pageSize=" + pageSize + "}";
  }
}
