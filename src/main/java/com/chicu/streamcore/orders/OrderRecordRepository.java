package com.chicu.streamcore.orders;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;

public interface OrderRecordRepository extends JpaRepository<OrderRecordEntity, String> {

    long countByStatusIn(Collection<OrderStatus> statuses);
}
