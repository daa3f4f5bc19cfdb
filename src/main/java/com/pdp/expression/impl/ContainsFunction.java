package com.pdp.expression.impl;

import com.pdp.attribute.AttributeType;
import com.pdp.attribute.AttributeValue;
import com.pdp.attribute.DomainName;
import com.pdp.attribute.Network;
import com.pdp.expression.Expression;
import com.pdp.expression.FunctionExpression;
import com.pdp.expression.FunctionType;
import com.pdp.session.EvaluationSession;

import java.net.InetAddress;
import java.util.List;
import java.util.Optional;

/**
 * Containment test. The first argument is the container, the second the candidate.
 * The overload is picked from the argument types when the policy is parsed.
 */
public class ContainsFunction extends FunctionExpression {

    /**
     * Supported (container, candidate) type pairs.
     */
    public enum Mode {
        SUBSTRING(AttributeType.STRING, AttributeType.STRING),
        NETWORK_ADDRESS(AttributeType.NETWORK, AttributeType.ADDRESS),
        SUBDOMAIN(AttributeType.DOMAIN, AttributeType.DOMAIN),
        STRING_SET(AttributeType.SET_OF_STRINGS, AttributeType.STRING),
        STRING_LIST(AttributeType.LIST_OF_STRINGS, AttributeType.STRING),
        NETWORK_SET(AttributeType.SET_OF_NETWORKS, AttributeType.ADDRESS),
        DOMAIN_SET(AttributeType.SET_OF_DOMAINS, AttributeType.DOMAIN);

        private final AttributeType container;
        private final AttributeType candidate;

        Mode(AttributeType container, AttributeType candidate) {
            this.container = container;
            this.candidate = candidate;
        }

        public static Optional<Mode> forTypes(AttributeType container, AttributeType candidate) {
            for (Mode mode : values()) {
                if (mode.container == container && mode.candidate == candidate) {
                    return Optional.of(mode);
                }
            }
            return Optional.empty();
        }
    }

    private final Mode mode;

    public ContainsFunction(Mode mode, Expression container, Expression candidate) {
        super(List.of(container, candidate), AttributeType.BOOLEAN);
        this.mode = mode;
    }

    @Override
    public AttributeValue evaluate(EvaluationSession session) {
        AttributeValue container = arguments.get(0).evaluate(session);
        AttributeValue candidate = arguments.get(1).evaluate(session);

        boolean result = switch (mode) {
            case SUBSTRING -> container.stringValue().contains(candidate.stringValue());
            case NETWORK_ADDRESS -> container.networkValue().contains(candidate.addressValue());
            case SUBDOMAIN -> container.domainValue().covers(candidate.domainValue());
            case STRING_SET -> container.stringSetValue().contains(candidate.stringValue());
            case STRING_LIST -> container.stringListValue().contains(candidate.stringValue());
            case NETWORK_SET -> anyNetworkContains(container, candidate.addressValue());
            case DOMAIN_SET -> anyDomainCovers(container, candidate.domainValue());
        };
        return AttributeValue.ofBoolean(result);
    }

    private static boolean anyNetworkContains(AttributeValue networks, InetAddress address) {
        for (Network network : networks.networkSetValue()) {
            if (network.contains(address)) {
                return true;
            }
        }
        return false;
    }

    private static boolean anyDomainCovers(AttributeValue domains, DomainName domain) {
        for (DomainName parent : domains.domainSetValue()) {
            if (parent.covers(domain)) {
                return true;
            }
        }
        return false;
    }

    public Mode getMode() {
        return mode;
    }

    @Override
    public FunctionType getFunctionType() {
        return FunctionType.CONTAINS;
    }
}
