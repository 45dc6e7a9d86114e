package com.companyintel.research.model;

/**
 * What a worker asks the tool provider to do in one task unit.
 *
 * @param domain    the domain issuing the instruction
 * @param query     the search or research query
 * @param iteration 1-based task unit number within the worker
 */
public record Instruction(ResearchDomain domain, String query, int iteration) {
}
