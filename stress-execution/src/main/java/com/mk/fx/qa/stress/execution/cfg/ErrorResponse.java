package com.mk.fx.qa.stress.execution.cfg;

/**
 * Body of every error answer of the REST layer.
 *
 * @param error short error title
 * @param details what went wrong
 */
public record ErrorResponse(String error, String details) {}
