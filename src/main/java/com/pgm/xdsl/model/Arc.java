package com.pgm.xdsl.model;

/** Directed edge from {@code parent} to {@code child}, both node ids. */
public record Arc(String parent, String child) {
}
