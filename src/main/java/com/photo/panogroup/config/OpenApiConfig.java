package com.photo.panogroup.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.responses.ApiResponse;
import org.springdoc.core.customizers.OpenApiCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * OpenAPI / Swagger 配置
 *
 * 访问地址：
 * - Swagger UI: http://localhost:{port}/swagger-ui.html
 * - API 文档 (JSON): http://localhost:{port}/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI panoGroupOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Pano Group API")
                        .description("""
                                全景照片重叠分组服务 API 文档

                                ## 功能概述

                                扫描目录中的照片，检测两两之间的重叠关系，把可以拼接成全景图的照片分组，
                                并可调用外部拼接工具逐组生成全景图。

                                ### 核心功能
                                - **分组**：SIFT / ORB 特征 + RANSAC 单应性验证，连通分量即分组
                                - **拼接**：按拍摄时间顺序把每组交给外部拼接工具链
                                - **缓存**：特征和重叠图按文件路径、修改时间持久化，可手动清理或按策略淘汰

                                ### 检测器
                                | 检测器 | 说明 |
                                |------|------|
                                | `SIFT` | 默认，精度高，速度较慢 |
                                | `ORB` | 二进制描述子，速度快；SIFT 不可用时自动降级到 ORB |

                                ### API 响应格式
                                ```json
                                {
                                  "status": "success | error",
                                  "data": { ... },
                                  "message": "错误信息（仅错误时）"
                                }
                                ```
                                """)
                        .version("1.0.0")
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")));
    }

    /**
     * 为所有接口添加统一的响应结构，POST 接口额外声明 400
     */
    @Bean
    public OpenApiCustomizer envelopeResponseCustomizer() {
        ApiResponse ok = envelope("成功", Map.of(
                "status", new Schema<>().type("string").description("状态: success/error").example("success"),
                "data", new Schema<>().type("object").description("响应数据")));
        ApiResponse badRequest = envelope("请求错误", Map.of(
                "status", new Schema<>().type("string").description("状态").example("error"),
                "message", new Schema<>().type("string").description("错误信息").example("Not a directory: /photos")));

        return openApi -> openApi.getPaths().values().forEach(pathItem -> pathItem.readOperations().forEach(operation -> {
            operation.getResponses().addApiResponse("200", ok);
            if (operation == pathItem.getPost()) {
                operation.getResponses().addApiResponse("400", badRequest);
            }
        }));
    }

    private static ApiResponse envelope(String description, Map<String, Schema> properties) {
        Schema<?> schema = new Schema<>();
        schema.setType("object");
        schema.setProperties(properties);
        return new ApiResponse()
                .description(description)
                .content(new Content().addMediaType("application/json", new MediaType().schema(schema)));
    }
}
