package com.conductor.status;

import java.time.Duration;

/**
 * Auxiliary process as shown in status.
 *
 * @param running  false when the process has exited since it was last started
 * @param exitCode exit code once exited, otherwise null
 * @param uptime   time since start, null once exited
 */
public record ProcessView(long pid, boolean running, Integer exitCode, Duration uptime) {}
