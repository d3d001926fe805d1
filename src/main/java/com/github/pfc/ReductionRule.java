package com.github.pfc;

/**
 * One rewrite applied by {@link ProcedureFunctionChart#reduce(java.util.List)}. A rule reports
 * whether it changed the chart; reduction repeats until no rule does.
 */
@FunctionalInterface
public interface ReductionRule {
  boolean apply(ProcedureFunctionChart chart) throws PfcException;
}
