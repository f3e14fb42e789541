package com.ledgersync.mapper;

import com.ledgersync.domain.model.Position;
import com.ledgersync.entity.PositionEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper between the Position domain model and PositionEntity.
 *
 * <p>The entity carries the owning account and an update timestamp, which the store sets.
 * The domain total PnL is derived and not persisted. Null PnL columns read as zero.
 */
@Mapper
public interface PositionMapper {

    @Mapping(target = "accountId", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    PositionEntity toEntity(Position position);

    @Mapping(target = "totalPnl", ignore = true)
    @Mapping(target = "exchange", defaultValue = "")
    @Mapping(target = "realizedPnl", defaultValue = "0")
    @Mapping(target = "unrealizedPnl", defaultValue = "0")
    @Mapping(target = "dailyPnl", defaultValue = "0")
    Position toDomain(PositionEntity entity);

    List<Position> toDomainList(List<PositionEntity> entities);
}
