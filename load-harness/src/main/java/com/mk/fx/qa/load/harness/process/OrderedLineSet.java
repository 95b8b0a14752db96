package com.mk.fx.qa.load.harness.process;

import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Set of text lines that keeps the order in which each distinct line was first added. */
public final class OrderedLineSet implements Iterable<String> {

  private final Set<String> lines = new LinkedHashSet<>();

  public static OrderedLineSet of(Collection<String> lines) {
    var set = new OrderedLineSet();
    lines.forEach(set::add);
    return set;
  }

  /** Adds a line, returning false when it was already present. */
  public boolean add(String line) {
    return lines.add(line);
  }

  public int size() {
    return lines.size();
  }

  public boolean isEmpty() {
    return lines.isEmpty();
  }

  public List<String> toList() {
    return List.copyOf(lines);
  }

  public String join() {
    return String.join(System.lineSeparator(), lines);
  }

  @Override
  public Iterator<String> iterator() {
    return toList().iterator();
  }
}
