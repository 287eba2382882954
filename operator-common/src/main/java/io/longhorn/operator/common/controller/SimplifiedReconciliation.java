/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.common.controller;

import io.longhorn.operator.common.Reconciliation;

/**
 * Lightweight queue entry used instead of the full Reconciliation until a worker picks it up. Two entries are equal
 * when they point to the same resource, whatever triggered them, which lets the queue drop duplicates. The
 * reconciliation ID is only issued once the reconciliation really starts.
 */
public class SimplifiedReconciliation {
    final String kind;
    final String namespace;
    final String name;
    final String trigger;

    /**
     * SimplifiedReconciliation constructor with default (watch) trigger
     *
     * @param kind      Kind of the resource
     * @param namespace Namespace of the resource
     * @param name      Name of the resource
     */
    public SimplifiedReconciliation(String kind, String namespace, String name) {
        this(kind, namespace, name, "watch");
    }

    /**
     * SimplifiedReconciliation constructor with custom trigger
     *
     * @param kind      Kind of the resource
     * @param namespace Namespace of the resource
     * @param name      Name of the resource
     * @param trigger   Type of the trigger
     */
    public SimplifiedReconciliation(String kind, String namespace, String name, String trigger) {
        this.kind = kind;
        this.namespace = namespace;
        this.name = name;
        this.trigger = trigger;
    }

    /**
     * @return  Full reconciliation object with a fresh ID
     */
    public Reconciliation toReconciliation() {
        return new Reconciliation(trigger, kind, namespace, name);
    }

    /**
     * @param trigger   The new trigger
     *
     * @return  Entry for the same resource with a different trigger
     */
    public SimplifiedReconciliation withTrigger(String trigger) {
        return new SimplifiedReconciliation(kind, namespace, name, trigger);
    }

    /**
     * @return  Name of the lock guarding this resource. It consists of the kind, namespace and name.
     */
    public String lockName() {
        return kind + "::" + namespace + "::" + name;
    }

    public String kind() {
        return kind;
    }

    public String namespace() {
        return namespace;
    }

    public String name() {
        return name;
    }

    public String trigger() {
        return trigger;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        } else if (o == null || getClass() != o.getClass()) {
            return false;
        } else {
            SimplifiedReconciliation reconciliation = (SimplifiedReconciliation) o;

            return this.kind.equals(reconciliation.kind)
                    && this.name.equals(reconciliation.name)
                    && this.namespace.equals(reconciliation.namespace);
        }
    }

    @Override
    public int hashCode() {
        int result = 17;
        result = 31 * result + (kind != null ? kind.hashCode() : 0);
        result = 31 * result + (name != null ? name.hashCode() : 0);
        result = 31 * result + (namespace != null ? namespace.hashCode() : 0);
        return result;
    }

    @Override
    public String toString() {
        return kind + "(" + namespace + "/" + name + ")";
    }
}
