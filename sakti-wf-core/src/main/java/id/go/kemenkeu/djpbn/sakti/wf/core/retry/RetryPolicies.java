package id.go.kemenkeu.djpbn.sakti.wf.core.retry;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Registry holding one policy per {@link RetryPolicyName}. Missing entries
 * are filled with {@link RetryPolicy#defaults(RetryPolicyName)}.
 */
public final class RetryPolicies {

    private final Map<RetryPolicyName, RetryPolicy> policies;

    private RetryPolicies(Map<RetryPolicyName, RetryPolicy> overrides) {
        EnumMap<RetryPolicyName, RetryPolicy> all = new EnumMap<>(RetryPolicyName.class);
        for (RetryPolicyName name : RetryPolicyName.values()) {
            RetryPolicy override = overrides.get(name);
            if (override != null && override.getName() != name) {
                throw new IllegalArgumentException(
                    "Policy registered under " + name + " is named " + override.getName());
            }
            all.put(name, override != null ? override : RetryPolicy.defaults(name));
        }
        this.policies = Collections.unmodifiableMap(all);
    }

    public static RetryPolicies defaults() {
        return new RetryPolicies(Collections.emptyMap());
    }

    public static RetryPolicies of(Map<RetryPolicyName, RetryPolicy> overrides) {
        return new RetryPolicies(overrides);
    }

    public RetryPolicy get(RetryPolicyName name) {
        return policies.get(name);
    }

    public Map<RetryPolicyName, RetryPolicy> asMap() {
        return policies;
    }
}
