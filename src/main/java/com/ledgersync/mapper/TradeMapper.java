package com.ledgersync.mapper;

import com.ledgersync.domain.model.TradeRecord;
import com.ledgersync.entity.TradeEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/** MapStruct mapper between TradeRecord and TradeEntity. createdAt is set by the store. */
@Mapper
public interface TradeMapper {

    @Mapping(target = "createdAt", ignore = true)
    TradeEntity toEntity(TradeRecord trade);

    TradeRecord toDomain(TradeEntity entity);

    List<TradeRecord> toDomainList(List<TradeEntity> entities);
}
