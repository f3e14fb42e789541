package com.ledgersync.mapper;

import com.ledgersync.domain.model.HistoryEntry;
import com.ledgersync.entity.PositionHistoryEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/** MapStruct mapper from positions_history rows to HistoryEntry. */
@Mapper
public interface PositionHistoryMapper {

    @Mapping(target = "exchange", defaultValue = "")
    @Mapping(target = "realizedPnl", defaultValue = "0")
    HistoryEntry toDomain(PositionHistoryEntity entity);

    List<HistoryEntry> toDomainList(List<PositionHistoryEntity> entities);
}
