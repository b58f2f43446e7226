package com.restaurantbi.insightflow.infrastructure.persistence.validation;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.restaurantbi.insightflow.domain.repository.ValidationResultRepository;
import com.restaurantbi.insightflow.domain.validation.ValidationResult;
import com.restaurantbi.insightflow.infrastructure.persistence.validation.converter.ValidationResultConverter;
import com.restaurantbi.insightflow.infrastructure.persistence.validation.entity.ValidationResultDO;
import com.restaurantbi.insightflow.infrastructure.persistence.validation.mapper.ValidationResultMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * ValidationResultRepositoryImpl - 校验结论仓储实现
 * 
 * @author insightflow
 */
@Repository
public class ValidationResultRepositoryImpl implements ValidationResultRepository {
    
    private final ValidationResultMapper validationResultMapper;
    
    public ValidationResultRepositoryImpl(ValidationResultMapper validationResultMapper) {
        this.validationResultMapper = validationResultMapper;
    }
    
    @Override
    @Transactional
    public void save(ValidationResult result) {
        ValidationResultDO dataObject = ValidationResultConverter.toDataObject(result);
        if (validationResultMapper.selectById(result.getId()) == null) {
            validationResultMapper.insert(dataObject);
        } else {
            validationResultMapper.updateById(dataObject);
        }
    }
    
    @Override
    public Optional<ValidationResult> findById(String id) {
        return Optional.ofNullable(ValidationResultConverter.toDomain(validationResultMapper.selectById(id)));
    }
    
    @Override
    public List<ValidationResult> findByRunId(String runId) {
        return validationResultMapper.selectList(
                new LambdaQueryWrapper<ValidationResultDO>()
                    .eq(ValidationResultDO::getRunId, runId)
                    .orderByAsc(ValidationResultDO::getEvaluatedAt)
            ).stream()
            .map(ValidationResultConverter::toDomain)
            .collect(Collectors.toList());
    }
    
    @Override
    @Transactional
    public void deleteByRunId(String runId) {
        validationResultMapper.delete(
            new LambdaQueryWrapper<ValidationResultDO>().eq(ValidationResultDO::getRunId, runId));
    }
}
