package com.github.pfc;

/**
 * Discriminator for the three kinds of chart element.
 */
public enum PfcElementType {
  LINK, TRANSITION, STEP;
}
