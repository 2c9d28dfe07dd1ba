/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.fp.list;

import java.util.NoSuchElementException;

/**
 * Thrown when an operation that needs at least one element is invoked
 * on an empty list.
 */
public class EmptyListException extends NoSuchElementException
{
    private static final long serialVersionUID = 4419672851360925347L;

    public EmptyListException(String message) {
        super(message);
    }
}
