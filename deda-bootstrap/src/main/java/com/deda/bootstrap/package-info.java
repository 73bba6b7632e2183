/**
 * Start-up and shutdown of the core, and the facade the host application uses.
 */
package com.deda.bootstrap;
