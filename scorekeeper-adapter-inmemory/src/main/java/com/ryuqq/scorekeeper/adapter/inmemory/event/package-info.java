/**
 * In-memory subscriber that queues committed action results for announcement senders.
 */
package com.ryuqq.scorekeeper.adapter.inmemory.event;
