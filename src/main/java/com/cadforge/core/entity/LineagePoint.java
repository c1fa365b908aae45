package com.cadforge.core.entity;

/**
 * A workspace table as seen from a descendant: the workspace id and the
 * sequence up to which its versions are visible.
 */
public record LineagePoint(String workspaceId, long sequence) {}
