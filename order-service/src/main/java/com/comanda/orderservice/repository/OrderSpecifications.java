package com.comanda.orderservice.repository;

import com.comanda.orderservice.dto.OrderFilter;
import com.comanda.orderservice.model.Order;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

public final class OrderSpecifications {

    private OrderSpecifications() {
    }

    /**
     * Builds the list query for the given filter. A date filter covers the whole
     * calendar day in {@code zoneId}.
     */
    public static Specification<Order> matching(OrderFilter filter, ZoneId zoneId) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();

            if (filter.getStatus() != null) {
                predicates.add(cb.equal(root.get("status"), filter.getStatus()));
            }
            if (filter.getType() != null) {
                predicates.add(cb.equal(root.get("type"), filter.getType()));
            }
            if (filter.getWaiterId() != null) {
                predicates.add(cb.equal(root.get("waiterId"), filter.getWaiterId()));
            }
            if (filter.getTableId() != null) {
                predicates.add(cb.equal(root.get("tableId"), filter.getTableId()));
            }
            if (filter.getDate() != null) {
                Instant from = filter.getDate().atStartOfDay(zoneId).toInstant();
                Instant to = filter.getDate().plusDays(1).atStartOfDay(zoneId).toInstant();
                predicates.add(cb.greaterThanOrEqualTo(root.get("createdAt"), from));
                predicates.add(cb.lessThan(root.get("createdAt"), to));
            }

            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
