package com.vuong.pgconnect.core.connection;

import org.hibernate.Session;

/**
 * A unit of work run against an open Hibernate session.
 * @param <R> the result type
 */
@FunctionalInterface
public interface SessionWork<R> {

    R apply(Session session);
}
