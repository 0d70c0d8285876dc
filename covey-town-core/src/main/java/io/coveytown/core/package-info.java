/**
 * Transport-neutral value types shared by the Covey Town modules.
 */
package io.coveytown.core;
