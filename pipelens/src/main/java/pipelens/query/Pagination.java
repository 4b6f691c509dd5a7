/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.query;

import java.util.ArrayList;
import java.util.List;

/** Describes which slice of a result was returned, and how many items and pages there are. */
// @Immutable
public final class Pagination {

  public static Pagination of(PageRequest request, int totalItems) {
    if (request == null) throw new NullPointerException("request == null");
    if (totalItems < 0) throw new IllegalArgumentException("totalItems < 0");
    int totalPages = (int) ((totalItems + (long) request.pageSize - 1) / request.pageSize);
    return new Pagination(request.page, request.pageSize, totalItems, totalPages);
  }

  /** Returns the items of the requested page, or an empty list past the last page. */
  public static <T> List<T> slice(List<T> items, PageRequest request) {
    long from = Math.min(request.offset(), items.size());
    long to = Math.min(from + request.pageSize, items.size());
    return new ArrayList<>(items.subList((int) from, (int) to));
  }

  final int page, pageSize, totalItems, totalPages;

  Pagination(int page, int pageSize, int totalItems, int totalPages) {
    this.page = page;
    this.pageSize = pageSize;
    this.totalItems = totalItems;
    this.totalPages = totalPages;
  }

  public int page() {
    return page;
  }

  public int pageSize() {
    return pageSize;
  }

  public int totalItems() {
    return totalItems;
  }

  public int totalPages() {
    return totalPages;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Pagination)) return false;
    Pagination that = (Pagination) o;
    return page == that.page && pageSize == that.pageSize
      && totalItems == that.totalItems && totalPages == that.totalPages;
  }

  @Override public int hashCode() {
    int h = 1;
    h *= 1000003;
    h ^= page;
    h *= 1000003;
    h ^= pageSize;
    h *= 1000003;
    h ^= totalItems;
    h *= 1000003;
    h ^= totalPages;
    return h;
  }

  @Override public String toString() {
    return "Pagination{page=" + page + ", pageSize=" + pageSize + ", totalItems=" + totalItems
      + ", totalPages=" + totalPages + "}";
  }
}
