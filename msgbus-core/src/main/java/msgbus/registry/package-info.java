/**
 * Type registry and per-type subscription table.
 *
 * <p>Subscriptions are opaque {@link msgbus.registry.Subscription} handles; a
 * {@link msgbus.registry.SubscriptionScope} groups handles for bulk cancellation.
 *
 * @see msgbus.registry.DefaultTypeRegistry
 * @see msgbus.registry.DefaultSubscriptionRegistry
 */
package msgbus.registry;
