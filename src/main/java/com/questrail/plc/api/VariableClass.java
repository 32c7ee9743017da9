package com.questrail.plc.api;

/**
 * VariableClass
 * -----------------------------------------------------------------------------
 * The memory area a variable lives in.
 *
 * <ul>
 *   <li>{@link #INPUT}: driven from outside (plant sensors, supervisory commands);
 *       programs may read but never assign</li>
 *   <li>{@link #OUTPUT}: written by the program, published to plant and supervisor</li>
 *   <li>{@link #INTERNAL}: scratch state private to the program</li>
 * </ul>
 *
 * <p>The declaration order of the constants is also the read lookup order.</p>
 */
public enum VariableClass
{
    INPUT,
    OUTPUT,
    INTERNAL
}
