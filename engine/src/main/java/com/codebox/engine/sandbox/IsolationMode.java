package com.codebox.engine.sandbox;

/**
 * How the child interpreter is fenced off from the host.
 *
 * BUBBLEWRAP - bwrap: read-only interpreter runtime, private /tmp, the
 *              workspace as the only writable directory, fresh pid/ipc/uts
 *              namespaces and no network unless the policy allows it.
 * NAMESPACE  - unshare: only drops the network when the policy denies it.
 * NONE       - plain child process. Development and tests only.
 */
public enum IsolationMode {
    BUBBLEWRAP,
    NAMESPACE,
    NONE
}
