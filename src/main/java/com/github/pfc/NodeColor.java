package com.github.pfc;

/**
 * Transient traversal marker shared by the graph algorithms. Every algorithm that uses it paints
 * all nodes white before it starts.
 */
public enum NodeColor {
  WHITE, GRAY, RED, BLACK;
}
