/**
 * Gated asset lifecycle: asset ids, gate states, gating rules and the manager that delegates
 * transition side effects to the active plugins.
 */
package com.deda.lifecycle;
