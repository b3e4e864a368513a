/**
 * Workflow execution lifecycle events: in-process bus and Redis pub/sub publisher.
 */
package com.forge.events;
