package com.cadforge.core.entity;

import com.cadforge.core.model.Constraint;
import com.cadforge.core.model.Entity;

import java.util.List;
import java.util.Map;

/**
 * An entity with its derived geometry, children and constraints.
 *
 * @param entity      current version
 * @param properties  derived properties from the geometry engine
 * @param childIds    visible entities listing this one as parent
 * @param constraints constraints referencing this entity
 */
public record EntityDetails(
    Entity entity,
    Map<String, Double> properties,
    List<String> childIds,
    List<Constraint> constraints
) {}
