/*
 * Where: notification API
 * What: standard error body
 * Why: every mapped exception has the same response shape
 */
package com.fiveschedule.notification.api;

public record ApiErrorResponse(String code, String message) {}
